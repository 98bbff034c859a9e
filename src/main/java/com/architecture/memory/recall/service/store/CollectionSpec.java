package com.architecture.memory.recall.service.store;

import lombok.Value;

/**
 * A named collection with one named dense-vector field of fixed dimension, cosine distance.
 */
@Value
public class CollectionSpec {
    String name;
    String vectorField;
    int dimension;
}
