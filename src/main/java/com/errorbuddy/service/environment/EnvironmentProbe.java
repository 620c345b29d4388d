package com.errorbuddy.service.environment;

import java.util.concurrent.Callable;

/**
 * One independently gathered environment fact.
 */
public interface EnvironmentProbe {

    String name();

    Object collect() throws Exception;

    static EnvironmentProbe of(String name, Callable<Object> source) {
        return new EnvironmentProbe() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Object collect() throws Exception {
                return source.call();
            }

            @Override
            public String toString() {
                return "EnvironmentProbe[" + name + "]";
            }
        };
    }
}
