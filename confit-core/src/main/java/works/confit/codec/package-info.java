/**
 * Converts between configuration trees and Java objects
 * according to {@link works.confit.mapping.spec.TargetSpec TargetSpec}s.
 */
package works.confit.codec;
