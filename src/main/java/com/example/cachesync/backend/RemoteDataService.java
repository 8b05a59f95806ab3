package com.example.cachesync.backend;

import java.util.Map;

/**
 * The remote data service the cache sits in front of.
 */
@FunctionalInterface
public interface RemoteDataService {

    Object call(String name, Map<String, ?> params) throws Exception;
}
