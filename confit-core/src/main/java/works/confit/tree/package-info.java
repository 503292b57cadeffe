/**
 * The generic, format-agnostic representation of a parsed configuration document.
 * <p>
 * A {@link works.confit.tree.TreeValue} tree is produced by a format collaborator
 * (HOCON, JSON, YAML...) and is only ever read by the decoder.
 * All the variants are immutable.
 * Positions within a tree are described by {@link works.confit.tree.ConfigPath}.
 */
package works.confit.tree;
