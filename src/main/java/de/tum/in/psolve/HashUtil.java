/*
 * This file is part of PSolve.
 * Copyright (c) 2024 The PSolve authors.
 *
 * PSolve is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PSolve is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PSolve. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.psolve;

final class HashUtil {
    // FNV-1a over the 4 bytes of each key

    static final int PRIME = 0x1000193;
    static final int OFFSET_BASIS = 0x811C9DC5;

    private HashUtil() {}

    static int fnv1aHash(int hash, int key) {
        int result = hash;
        result = (result ^ (key & 0xFF)) * PRIME;
        result = (result ^ ((key >>> 8) & 0xFF)) * PRIME;
        result = (result ^ ((key >>> 16) & 0xFF)) * PRIME;
        result = (result ^ (key >>> 24)) * PRIME;
        return result;
    }

    static int fnv1aHash(int[] keys) {
        int hash = OFFSET_BASIS;
        for (int key : keys) {
            hash = fnv1aHash(hash, key);
        }
        return hash;
    }
}
