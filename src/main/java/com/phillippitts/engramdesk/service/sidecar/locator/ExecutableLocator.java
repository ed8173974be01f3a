package com.phillippitts.engramdesk.service.sidecar.locator;

import com.phillippitts.engramdesk.exception.ExecutableNotFoundException;

/**
 * Resolves how to launch the worker process.
 *
 * <p>Implementations must be deterministic and side-effect free: each candidate check is a
 * filesystem existence test.
 */
public interface ExecutableLocator {

    /**
     * Resolves the worker command line for the given environment.
     *
     * @param environment runtime facts to resolve against
     * @return the first matching command
     * @throws ExecutableNotFoundException if every candidate is exhausted
     */
    CommandSpec locate(LocatorEnvironment environment);
}
