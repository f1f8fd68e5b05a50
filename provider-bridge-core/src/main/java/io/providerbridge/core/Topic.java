package io.providerbridge.core;

import java.util.Objects;

public record Topic(String name, String datatype) {
    public Topic {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(datatype, "datatype");
    }
}
