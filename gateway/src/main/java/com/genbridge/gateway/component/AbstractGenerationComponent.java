package com.genbridge.gateway.component;

/**
 * Base class deriving the {@link ComponentSpec} from the input/output record types.
 */
public abstract class AbstractGenerationComponent<I, O> implements GenerationComponent<I, O> {

    private final ComponentSpec spec;
    private final Class<I>      inputType;

    protected AbstractGenerationComponent(String name, String description, Class<I> inputType, Class<O> outputType) {
        this.spec      = new ComponentSpec(name, description,
                RecordSchemas.schemaFor(inputType), RecordSchemas.schemaFor(outputType));
        this.inputType = inputType;
    }

    @Override
    public ComponentSpec spec() {
        return spec;
    }

    @Override
    public Class<I> inputType() {
        return inputType;
    }
}
