package br.com.analytics.pipeline.farmer_kpi_batch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Launches the job named by {@code farmer-kpi.job-name}. Non-option arguments of the form {@code key=value}
 * become string job parameters, e.g. {@code referenceDate=2024-06-30 farmerId=42}.
 */
@Component
public class KpiJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(KpiJobRunner.class);

    private final Map<String, Job> jobs;
    private final JobLauncher jobLauncher;
    private final FarmerKpiProperties properties;

    private int exitCode;

    // the batch configuration exposes its launcher as the job operator bean
    public KpiJobRunner(Map<String, Job> jobs, JobLauncher jobOperator, FarmerKpiProperties properties) {
        this.jobs = jobs;
        this.jobLauncher = jobOperator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Job job = jobs.get(properties.jobName());
        if (job == null) {
            log.error("Unknown job '{}', available: {}", properties.jobName(), jobs.keySet());
            exitCode = 2;
            return;
        }

        JobParameters parameters = toJobParameters(args.getNonOptionArgs());
        log.info("Launching {} with {}", job.getName(), parameters);
        JobExecution execution = jobLauncher.run(job, parameters);
        log.info("{} finished with status {}", job.getName(), execution.getStatus());
        if (execution.getStatus().isUnsuccessful()) {
            exitCode = 1;
        }
    }

    static JobParameters toJobParameters(List<String> arguments) {
        JobParametersBuilder builder = new JobParametersBuilder();
        for (String argument : arguments) {
            int separator = argument.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Job parameter must be key=value: " + argument);
            }
            builder.addString(argument.substring(0, separator).trim(), argument.substring(separator + 1).trim());
        }
        builder.addLong("launchedAt", System.currentTimeMillis());
        return builder.toJobParameters();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
