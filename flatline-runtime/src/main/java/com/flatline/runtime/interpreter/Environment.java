package com.flatline.runtime.interpreter;

import java.util.HashMap;
import java.util.Map;

/**
 * 词法环境：变量名到值的映射，沿父链查找
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, Object> values = new HashMap<String, Object>();

    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment getParent() {
        return parent;
    }

    public void define(String name, Object value) {
        values.put(name, value);
    }

    public boolean isDefined(String name) {
        if (values.containsKey(name)) return true;
        return parent != null && parent.isDefined(name);
    }

    public Object get(String name) {
        Environment env = find(name);
        if (env == null) {
            throw new FlatlineRuntimeException("Undefined variable '" + name + "'");
        }
        return env.values.get(name);
    }

    public void assign(String name, Object value) {
        Environment env = find(name);
        if (env == null) {
            throw new FlatlineRuntimeException("Undefined variable '" + name + "'");
        }
        env.values.put(name, value);
    }

    private Environment find(String name) {
        Environment env = this;
        while (env != null) {
            if (env.values.containsKey(name)) return env;
            env = env.parent;
        }
        return null;
    }
}
