package com.github.dimitryivaniuta.egress.cache;

public record CacheMemoryInfo(Distributed distributed, Local local) {

    public record Distributed(long used, long peak, double fragmentation) {

        static Distributed unknown() {
            return new Distributed(0, 0, 1.0);
        }
    }

    public record Local(long used, long keyCount) {}
}
