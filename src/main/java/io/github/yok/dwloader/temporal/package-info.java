/**
 * Temporal dimension handling: validity interval correction of slowly-changing dimensions and
 * point-in-time resolution of fact rows.
 */
package io.github.yok.dwloader.temporal;
