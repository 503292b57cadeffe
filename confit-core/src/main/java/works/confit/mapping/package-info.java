/**
 * Builds and caches the {@link works.confit.mapping.spec.TargetSpec TargetSpec}s
 * describing how to decode Java types, and tracks the implementations of open interfaces.
 *
 * @see works.confit.mapping.TypeScanner
 * @see works.confit.mapping.SubclassRegistry
 */
package works.confit.mapping;
