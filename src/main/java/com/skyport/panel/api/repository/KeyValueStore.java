package com.skyport.panel.api.repository;

import java.util.Optional;

/**
 * Plain get/set store of JSON documents by key. Writes to different keys are independent; there is
 * no transaction spanning them.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String json);
}
