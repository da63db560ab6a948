package io.quarkiverse.stickyheader;

public class UnsupportedCapabilityException extends RuntimeException {

    private final Class<? extends ResponseCapability> capability;

    public UnsupportedCapabilityException(Class<? extends ResponseCapability> capability) {
        super("Response does not support " + capability.getSimpleName());
        this.capability = capability;
    }

    public Class<? extends ResponseCapability> getCapability() {
        return capability;
    }
}
