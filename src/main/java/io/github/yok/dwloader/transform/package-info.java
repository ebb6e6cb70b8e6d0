/**
 * Type and cleanse rules that turn bronze rows (all strings) into typed silver rows.
 */
package io.github.yok.dwloader.transform;
