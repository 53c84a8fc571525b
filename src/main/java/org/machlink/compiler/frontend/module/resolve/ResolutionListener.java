package org.machlink.compiler.frontend.module.resolve;

import org.machlink.compiler.frontend.module.error.ImportException;
import org.machlink.compiler.frontend.module.error.UrlImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Side channel receiving the typed reason behind an empty resolution result.
 */
@FunctionalInterface
public interface ResolutionListener {

    void onFailure(ImportException failure);

    /**
     * Returns a listener that only logs. Network failures are logged at WARN, everything else at DEBUG.
     */
    static ResolutionListener logging() {
        Logger log = LoggerFactory.getLogger(ResolutionListener.class);
        return failure -> {
            if (failure instanceof UrlImportException) {
                log.warn("{}", failure.getMessage());
                log.debug("URL import failure details", failure);
            } else {
                log.debug("{}", failure.getMessage());
            }
        };
    }
}
