package com.seorag.index;

record IndexState(Status status, String reason, IndexVersion version) {
    enum Status {
        VALID,
        MISSING,
        INCOMPATIBLE
    }

    boolean usable() {
        return status == Status.VALID;
    }
}
