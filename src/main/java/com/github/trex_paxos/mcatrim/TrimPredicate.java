package com.github.trex_paxos.mcatrim;

/// Decides whether a chunk is trimmed. Implementations read fields through the scan accessors of
/// [ChunkFields] only; a missing field fails the whole container.
@FunctionalInterface
public interface TrimPredicate {

    TrimPredicate NONE = chunk -> false;

    boolean shouldTrim(ChunkFields chunk) throws RegionFormatException;
}
