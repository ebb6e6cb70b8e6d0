/**
 * Readers of source extracts.
 */
package io.github.yok.dwloader.parser;
