package com.nanik.finhub.catalog;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A parsed registration payload: one worker instance and the tools it declares.
 */
public class Registration {

    private final WorkerInstance instance;
    private final List<ToolDescriptor> tools;

    public Registration(WorkerInstance instance, List<ToolDescriptor> tools) {
        this.instance = instance;
        this.tools = Collections.unmodifiableList(tools);
    }

    public WorkerInstance getInstance() {
        return instance;
    }

    public List<ToolDescriptor> getTools() {
        return tools;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Registration)) {
            return false;
        }
        Registration that = (Registration) o;
        return instance.equals(that.instance) && tools.equals(that.tools);
    }

    @Override
    public int hashCode() {
        return Objects.hash(instance, tools);
    }
}
