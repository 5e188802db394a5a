package com.huntflow.display;

/**
 * Output artifact of a statement or a block
 */
public interface Display {

    /**
     * Plain-text rendering for terminals and logs
     */
    String render();
}
