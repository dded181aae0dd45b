/**
 * Dependency graph package.
 *
 * <p>{@link io.giantt.graph.ItemGraph} owns relation mirroring, validate-before-commit
 * mutation and topological ordering; {@link io.giantt.graph.CycleDetector} holds the
 * strict-edge DFS shared by every mutation.
 */
package io.giantt.graph;
