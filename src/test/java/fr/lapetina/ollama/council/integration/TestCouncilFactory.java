package fr.lapetina.ollama.council.integration;

import fr.lapetina.ollama.council.CouncilFactory;

/**
 * Test extension of CouncilFactory that routes every model call to a {@link StubModelGateway}.
 */
public final class TestCouncilFactory extends CouncilFactory {

    private final StubModelGateway stubGateway;

    private TestCouncilFactory(String configPath, StubModelGateway stubGateway) {
        super(configPath, stubGateway);
        this.stubGateway = stubGateway;
    }

    /**
     * Creates a test factory from the default test configuration.
     */
    public static TestCouncilFactory create() {
        return create("test-config.yaml");
    }

    /**
     * Creates a test factory from a custom configuration path.
     */
    public static TestCouncilFactory create(String configPath) {
        TestCouncilFactory factory = new TestCouncilFactory(configPath, new StubModelGateway());
        factory.start();
        return factory;
    }

    public StubModelGateway getStubGateway() {
        return stubGateway;
    }
}
