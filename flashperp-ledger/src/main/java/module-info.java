module com.flashperp.ledger {
    // Exports
    exports com.flashperp.ledger;
    exports com.flashperp.ledger.admin;
    exports com.flashperp.ledger.config;
    exports com.flashperp.ledger.custody;
    exports com.flashperp.ledger.funding;
    exports com.flashperp.ledger.journal;
    exports com.flashperp.ledger.liquidation;
    exports com.flashperp.ledger.price;
    exports com.flashperp.ledger.state;

    // Dependencies
    requires transitive com.flashperp.core;
    requires com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;
    requires com.fasterxml.jackson.dataformat.yaml;
    requires org.slf4j;

    // Jackson needs reflection access
    opens com.flashperp.ledger.journal to com.fasterxml.jackson.databind;
    opens com.flashperp.ledger.config to com.fasterxml.jackson.databind;
}
