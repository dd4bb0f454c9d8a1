package io.btreeset.collections.btree;

public enum NodeKind {
    ROOT,
    INTERNAL,
    LEAF
}
