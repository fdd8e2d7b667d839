// file: client/src/main/java/io/revlite/client/replica/LoadRequest.java
package io.revlite.client.replica;

import io.revlite.core.Address;
import io.revlite.core.SchemaContext;

import java.util.Objects;

/** An address to make available locally, optionally with the schema describing its links. */
public record LoadRequest(Address address, SchemaContext schema) {

    public LoadRequest {
        Objects.requireNonNull(address, "address");
    }

    public static LoadRequest of(Address address) {
        return new LoadRequest(address, null);
    }

    public boolean hasSchema() {
        return schema != null;
    }
}
