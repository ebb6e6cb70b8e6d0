/**
 * Run ledger: the append-only audit record of pipeline runs and of every unit they executed.
 */
package io.github.yok.dwloader.ledger;
