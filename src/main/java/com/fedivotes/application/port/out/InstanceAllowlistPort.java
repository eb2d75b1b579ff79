package com.fedivotes.application.port.out;

import java.util.Set;

/**
 * Set of instance host names whose objects may be looked up.
 */
public interface InstanceAllowlistPort {

    boolean isKnownInstance(String host);

    void replaceAll(Set<String> hosts);

    int size();
}
