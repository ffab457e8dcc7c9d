package com.libragraph.depot.core.bundle;

import com.libragraph.depot.core.registry.model.CreateBundleRequest;
import com.libragraph.depot.formats.archive.PayloadMatching;

/**
 * @param apiVersion      bundle schema to create, see {@link CreateBundleRequest}
 * @param payloadMatching how archive payloads are paired with manifest entries
 */
public record PushOptions(int apiVersion, PayloadMatching payloadMatching) {

    public PushOptions {
        payloadMatching = payloadMatching == null ? PayloadMatching.STRICT : payloadMatching;
    }

    public static PushOptions defaults() {
        return new PushOptions(CreateBundleRequest.CURRENT_API_VERSION, PayloadMatching.STRICT);
    }
}
