module io.github.cyfko.docfilter.core {
    requires java.logging;
    requires org.mongodb.bson;

    exports io.github.cyfko.docfilter.core;
    exports io.github.cyfko.docfilter.core.compose;
    exports io.github.cyfko.docfilter.core.config;
    exports io.github.cyfko.docfilter.core.exception;
    exports io.github.cyfko.docfilter.core.json;
    exports io.github.cyfko.docfilter.core.merge;
    exports io.github.cyfko.docfilter.core.model;
    exports io.github.cyfko.docfilter.core.search;
    exports io.github.cyfko.docfilter.core.utils;
}
