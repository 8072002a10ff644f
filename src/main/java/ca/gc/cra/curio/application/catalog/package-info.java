/**
 * Library catalog aggregate and item factory.
 */
package ca.gc.cra.curio.application.catalog;
