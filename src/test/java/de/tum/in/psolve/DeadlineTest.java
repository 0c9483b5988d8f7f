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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class DeadlineTest {
    @Test
    public void testNoneNeverExpires() {
        assertThat(Deadline.afterMillis(0).isExpired(), is(false));
        assertThat(Deadline.afterMillis(-5), is(Deadline.NONE));
        Deadline.NONE.check("anything");
    }

    @Test
    public void testExpiry() throws InterruptedException {
        Deadline deadline = Deadline.afterMillis(1);
        Thread.sleep(20);
        assertThat(deadline.isExpired(), is(true));
        SolverTimeoutException exception = assertThrows(SolverTimeoutException.class, () -> deadline.check("test"));
        assertThat(exception.getMessage(), containsString("test"));
    }

    @Test
    public void testGenerousBudget() {
        Deadline deadline = Deadline.afterMillis(60_000);
        assertThat(deadline.isExpired(), is(false));
        deadline.check("test");
    }
}
