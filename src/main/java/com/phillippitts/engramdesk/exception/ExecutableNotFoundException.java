package com.phillippitts.engramdesk.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when no candidate location holds the engram worker (bundled runtime or
 * {@code bin/engram.js} source tree). Fatal to the start attempt that triggered the lookup.
 */
public class ExecutableNotFoundException extends EngramDeskException {

    private final List<Path> searchedLocations;

    public ExecutableNotFoundException(List<Path> searchedLocations) {
        super("Could not locate engram project root. Ensure bin/engram.js is accessible. Searched: "
                + searchedLocations);
        this.searchedLocations = List.copyOf(searchedLocations);
    }

    public List<Path> getSearchedLocations() {
        return searchedLocations;
    }
}
