/**
 * LISTEN/NOTIFY subscriber and the DDL helpers that install notify triggers.
 */
package io.pgcom.listen;
