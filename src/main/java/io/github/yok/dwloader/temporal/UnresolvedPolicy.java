package io.github.yok.dwloader.temporal;

/**
 * Handling of a fact whose dimension reference cannot be resolved.
 *
 * @author Yasuharu.Okawauchi
 */
public enum UnresolvedPolicy {
    // Point the fact at the unknown member row of the dimension
    UNKNOWN_MEMBER,
    // Fail the gold build with an IntegrityException
    FAIL
}
