module com.flashperp.core {
    // Exports
    exports com.flashperp.core.math;
    exports com.flashperp.core.model;
    exports com.flashperp.core.exception;
}
