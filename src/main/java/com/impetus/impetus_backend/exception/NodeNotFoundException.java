package com.impetus.impetus_backend.exception;

import lombok.Getter;

/**
 * No node with the given id lives in the graph currently being edited.
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        super("Node not found in the active graph: " + nodeId);
        this.nodeId = nodeId;
    }
}
