/**
 * The analyses the reference counting optimisations consult, as interfaces a driver may supply
 * its own implementations of, along with the default implementations.
 */
package io.github.eutro.rcopt.core.analysis;
