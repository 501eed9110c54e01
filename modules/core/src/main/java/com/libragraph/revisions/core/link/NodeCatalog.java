package com.libragraph.revisions.core.link;

/**
 * Read-only view of the roadmap graph that owns nodes. Nodes live outside this
 * service; links only need to know whether an id names one.
 */
public interface NodeCatalog {

    boolean exists(String nodeId);
}
