package com.maxdemarzi.minilogic.runtime;

import com.maxdemarzi.minilogic.ast.Bit;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;

import java.util.Map;

/**
 * Parameter bindings of a single function activation.
 */
public class LocalScope {
    private final MutableMap<String, Bit> parameters = UnifiedMap.newMap();

    public LocalScope bind(String name, Bit value) {
        parameters.put(name, value);
        return this;
    }

    public Map<String, Bit> asMap() {
        return parameters.asUnmodifiable();
    }
}
