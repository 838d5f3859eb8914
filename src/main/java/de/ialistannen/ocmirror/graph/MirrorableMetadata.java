package de.ialistannen.ocmirror.graph;

/**
 * Resolved metadata that can be replicated to another registry.
 */
public interface MirrorableMetadata {

  ContentGraph graph();
}
