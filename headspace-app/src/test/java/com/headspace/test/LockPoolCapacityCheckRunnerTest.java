package com.headspace.test;

import com.headspace.config.AdvisoryLockProperties;
import com.headspace.config.LockPoolCapacityCheckRunner;
import com.headspace.config.ThreadPoolConfigProperties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class LockPoolCapacityCheckRunnerTest {

    @Test
    public void shouldRequireTwoConnectionsPerPotentialHolder() {
        AdvisoryLockProperties lockProperties = new AdvisoryLockProperties();
        lockProperties.setPeakForegroundHolders(8);
        ThreadPoolConfigProperties poolProperties = new ThreadPoolConfigProperties();
        poolProperties.setMaxPoolSize(4);

        LockPoolCapacityCheckRunner runner = new LockPoolCapacityCheckRunner(lockProperties, poolProperties, 40, 4);

        Assertions.assertEquals(32, runner.requiredConnections());
        Assertions.assertDoesNotThrow(() -> runner.run(null));
    }

    @Test
    public void shouldOnlyLogWhenPoolTooSmallAndFailFastDisabled() {
        LockPoolCapacityCheckRunner runner = new LockPoolCapacityCheckRunner(new AdvisoryLockProperties(),
                new ThreadPoolConfigProperties(), 10, 4);

        Assertions.assertDoesNotThrow(() -> runner.run(null));
    }

    @Test
    public void shouldFailStartupWhenPoolTooSmallAndFailFastEnabled() {
        AdvisoryLockProperties lockProperties = new AdvisoryLockProperties();
        lockProperties.getCapacityCheck().setFailFast(true);
        LockPoolCapacityCheckRunner runner = new LockPoolCapacityCheckRunner(lockProperties,
                new ThreadPoolConfigProperties(), 10, 4);

        IllegalStateException ex = Assertions.assertThrows(IllegalStateException.class, () -> runner.run(null));
        Assertions.assertTrue(ex.getMessage().contains("required=32"));
    }
}
