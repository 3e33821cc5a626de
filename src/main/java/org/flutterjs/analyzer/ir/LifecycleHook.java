package org.flutterjs.analyzer.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle callbacks a state holder may override.
 */
public enum LifecycleHook {
    INIT_STATE("initState"),
    DISPOSE("dispose"),
    DID_UPDATE_WIDGET("didUpdateWidget"),
    DID_CHANGE_DEPENDENCIES("didChangeDependencies"),
    DEACTIVATE("deactivate"),
    REASSEMBLE("reassemble");

    private final String methodName;

    LifecycleHook(String methodName) {
        this.methodName = methodName;
    }

    public String methodName() {
        return methodName;
    }

    /**
     * @param methodName A method name.
     * @return The hook implemented by a method of that name, if any.
     */
    public static Optional<LifecycleHook> forMethod(String methodName) {
        return Arrays.stream(values()).filter(h -> h.methodName.equals(methodName)).findFirst();
    }
}
