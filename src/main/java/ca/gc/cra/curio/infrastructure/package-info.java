/**
 * Infrastructure adapters implementing application ports.
 */
package ca.gc.cra.curio.infrastructure;
