package com.nodeguardian.domain.model;

/** A pod scheduled on a node, as returned by the node control API. */
public record PodRef(String namespace, String name) {

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
