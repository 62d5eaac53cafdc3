package com.di.statsrollup;

import com.di.statsrollup.config.RollupProperties;
import com.di.statsrollup.job.RollupJobService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. Intended to be invoked once per collection window by an external scheduler
 * (e.g. cron every minute): runs one rollup and exits, non-zero when the run failed.
 */
@SpringBootApplication
public class StatsRollupApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(StatsRollupApplication.class, args);
		RollupProperties props = ctx.getBean(RollupProperties.class);
		if (!props.isRunOnStartup()) {
			return;
		}
		int exitCode = runOnce(ctx);
		System.exit(SpringApplication.exit(ctx, () -> exitCode));
	}

	static int runOnce(ConfigurableApplicationContext ctx) {
		try {
			ctx.getBean(RollupJobService.class).runOnce();
			return 0;
		} catch (RuntimeException e) {
			// already logged with its category by the job
			return 1;
		}
	}
}
