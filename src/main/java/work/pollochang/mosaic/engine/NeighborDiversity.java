package work.pollochang.mosaic.engine;

public enum NeighborDiversity {
    ENABLED,
    DISABLED
}
