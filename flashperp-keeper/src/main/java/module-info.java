module com.flashperp.keeper {
    // Exports - public API
    exports com.flashperp.keeper;

    // Dependencies
    requires com.flashperp.ledger;
    requires org.slf4j;
    requires org.apache.logging.log4j;
}
