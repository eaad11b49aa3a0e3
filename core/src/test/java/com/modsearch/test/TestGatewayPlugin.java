package com.modsearch.test;

import com.modsearch.api.ContentGateway;
import com.modsearch.api.ModSearchPlugin;
import com.modsearch.core.Kernel;

/**
 * Registers a {@link FakeGateway}. Discovered through the test classpath service registration.
 */
public class TestGatewayPlugin implements ModSearchPlugin {
    public static final String NAME = "TestGateway";

    private Kernel kernel;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return "0.0.1";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        kernel.registerService(ContentGateway.class, new FakeGateway().withItems(3));
    }

    @Override
    public void onDisable() {
        kernel.unregisterService(ContentGateway.class);
    }
}
