/**
 * Decodes parsed configuration documents into records, enums, collections and scalars,
 * guided by the declared Java types.
 * <p>
 * Start with {@link works.confit.Confit}. Format-specific loaders that turn
 * HOCON, JSON or YAML text into {@link works.confit.tree.TreeValue}s live in separate modules.
 */
package works.confit;
