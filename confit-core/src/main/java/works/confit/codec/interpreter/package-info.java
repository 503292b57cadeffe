/**
 * {@link works.confit.codec.Codec Codec} implementations that walk the
 * {@link works.confit.mapping.spec.TargetSpec TargetSpec} tree directly.
 */
package works.confit.codec.interpreter;
