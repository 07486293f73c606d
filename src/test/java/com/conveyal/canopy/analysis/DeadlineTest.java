package com.conveyal.canopy.analysis;

import com.conveyal.canopy.PlantabilityException;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;

public class DeadlineTest {

    @Test
    public void noDeadlineNeverExpires () {
        Deadline.none().check("scoring");
        assertThat(Deadline.none().isExpired(), equalTo(false));
    }

    @Test
    public void distantDeadlinePasses () {
        Deadline.after(1, TimeUnit.HOURS).check("scoring");
    }

    @Test
    public void expiredDeadlineNamesStage () {
        try {
            Deadline.after(0, TimeUnit.SECONDS).check("mask generation");
            fail("Expected timeout.");
        } catch (PlantabilityException e) {
            assertThat(e.isTimeout(), equalTo(true));
            assertThat(e.getMessage(), containsString("mask generation"));
        }
    }

    @Test
    public void longestDeadlineDoesNotWrapAround () {
        Deadline deadline = Deadline.after(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        assertThat(deadline.isExpired(), equalTo(false));
        deadline.check("scoring");
    }
}
