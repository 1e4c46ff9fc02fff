package io.redisoperator.models;

import io.redisoperator.enums.TopologyKind;
import lombok.Value;

/**
 * Identity of a topology object in the work queue.
 */
@Value(staticConstructor = "of")
public class ObjectKey {
    TopologyKind kind;
    String namespace;
    String name;

    @Override
    public String toString() {
        return kind.getResourceKind() + " " + namespace + "/" + name;
    }
}
