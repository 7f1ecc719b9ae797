package com.vidnyan.guardian.application.port.out;

/**
 * Port for checking whether an analyzer binary can be launched on this host.
 */
public interface ToolLocator {

    boolean isAvailable(String executable);
}
