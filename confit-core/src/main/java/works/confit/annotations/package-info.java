/**
 * Annotations that adjust how record components and enums are decoded.
 */
package works.confit.annotations;
