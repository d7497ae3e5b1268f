package com.narrative.sge.engine;

import com.narrative.sge.api.VariableStore;
import com.narrative.sge.store.ColumnarVariableStore;
import com.narrative.sge.store.MapVariableStore;

/** Variable storage strategy of a run. */
public enum StoreKind {
    /** One tagged slot per name in a hash map. */
    MAP,
    /** Typed primitive columns keyed by name hash. */
    COLUMNAR;

    public VariableStore newStore() {
        return switch (this) {
            case MAP -> new MapVariableStore();
            case COLUMNAR -> new ColumnarVariableStore();
        };
    }
}
