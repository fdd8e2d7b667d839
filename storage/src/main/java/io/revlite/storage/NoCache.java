// file: storage/src/main/java/io/revlite/storage/NoCache.java
package io.revlite.storage;

import io.revlite.core.Address;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionMerger;

import java.util.Collection;
import java.util.Map;

/** Store that remembers nothing: every pull misses, every merge succeeds. */
public final class NoCache implements RevisionStore {

    public static final NoCache INSTANCE = new NoCache();

    private NoCache() {
    }

    @Override
    public Result<Map<Address, Revision>> pull(Collection<Address> addresses) {
        return Result.ok(Map.of());
    }

    @Override
    public Result<Void> merge(Collection<Revision> revisions, RevisionMerger merger) {
        return Result.done();
    }
}
