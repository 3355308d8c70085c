package org.springaicommunity.github.exporter;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for GitHub exports.
 *
 * <p>
 * This class is the single configuration surface of the exporter: rate limiter
 * constants, request timeout, per-resource-type item ceilings (which size the adaptive
 * retry strategy), cache settings, the checkpoint store location and batch defaults.
 * Properties can be set directly via setters and passed to {@link GitHubExporterBuilder}.
 *
 * <p>
 * Default values are tuned for the public GitHub REST quota of 5000 requests per hour.
 */
public class ExportProperties {

	/**
	 * Maximum number of upstream calls the rate limiter runs at the same time.
	 */
	private int maxConcurrent = 5;

	/**
	 * Minimum spacing between the start of two upstream calls.
	 */
	private Duration minTimeBetweenRequests = Duration.ofSeconds(1);

	/**
	 * Hourly request quota the reservoir is initialized and refilled to.
	 */
	private int hourlyQuota = 5000;

	/**
	 * How often the reservoir is refilled to the hourly quota.
	 */
	private Duration reservoirRefreshInterval = Duration.ofHours(1);

	/**
	 * Retries the rate limiter performs for a failed scheduled operation.
	 */
	private int limiterMaxRetries = 3;

	/**
	 * First backoff delay of the rate limiter (doubles on each retry).
	 */
	private Duration limiterInitialBackoff = Duration.ofSeconds(1);

	/**
	 * Remaining quota percentage under which a warning is logged.
	 */
	private int lowQuotaWarningPercent = 10;

	/**
	 * Remaining request count under which callers wait for the quota reset.
	 */
	private int criticalRemainingThreshold = 100;

	/**
	 * Timeout applied to every upstream request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * Maximum number of pull requests fetched per repository.
	 */
	private int maxPullRequests = 2000;

	/**
	 * Maximum number of issues fetched per repository.
	 */
	private int maxIssues = 2000;

	/**
	 * Maximum number of commits fetched per repository.
	 */
	private int maxCommits = 5000;

	/**
	 * Maximum number of branches fetched per repository.
	 */
	private int maxBranches = 500;

	/**
	 * Maximum number of releases fetched per repository.
	 */
	private int maxReleases = 500;

	/**
	 * Items requested per page (GitHub caps this at 100).
	 */
	private int pageSize = 100;

	/**
	 * Whether the durable response cache is used.
	 */
	private boolean cacheEnabled = true;

	/**
	 * Directory holding durable cache entries.
	 */
	private Path cacheDirectory = Path.of(System.getProperty("user.home"), ".github-exporter", "cache");

	/**
	 * Time-to-live of durable cache entries.
	 */
	private Duration cacheTtl = Duration.ofHours(24);

	/**
	 * Byte budget of the in-process cache (default: 200MB).
	 */
	private long memoryCacheMaxBytes = 200L * 1024 * 1024;

	/**
	 * Time-to-live of in-process cache entries.
	 */
	private Duration memoryCacheTtl = Duration.ofHours(1);

	/**
	 * Eviction policy of the in-process cache: LRU, LFU, FIFO or TTL.
	 */
	private String memoryCacheEvictionPolicy = "LRU";

	/**
	 * Interval of the in-process cache expiry sweep.
	 */
	private Duration memoryCacheSweepInterval = Duration.ofMinutes(5);

	/**
	 * Checkpoint document used for incremental exports.
	 */
	private Path stateFile = Path.of(System.getProperty("user.home"), ".github-exporter", "state", "exports.json");

	/**
	 * Number of repositories exported concurrently when a batch does not specify one.
	 */
	private int defaultParallelism = 3;

	/**
	 * Base directory for exported files.
	 */
	private Path outputDirectory = Path.of("github-export");

	/**
	 * Item ceiling configured for a resource type.
	 * @param type the resource type
	 * @return the maximum number of items fetched for that type
	 */
	public int getItemCeiling(ResourceType type) {
		return switch (type) {
			case PULL_REQUESTS -> maxPullRequests;
			case ISSUES -> maxIssues;
			case COMMITS -> maxCommits;
			case BRANCHES -> maxBranches;
			case RELEASES -> maxReleases;
		};
	}

	public int getMaxConcurrent() {
		return maxConcurrent;
	}

	public void setMaxConcurrent(int maxConcurrent) {
		this.maxConcurrent = maxConcurrent;
	}

	public Duration getMinTimeBetweenRequests() {
		return minTimeBetweenRequests;
	}

	public void setMinTimeBetweenRequests(Duration minTimeBetweenRequests) {
		this.minTimeBetweenRequests = minTimeBetweenRequests;
	}

	public int getHourlyQuota() {
		return hourlyQuota;
	}

	public void setHourlyQuota(int hourlyQuota) {
		this.hourlyQuota = hourlyQuota;
	}

	public Duration getReservoirRefreshInterval() {
		return reservoirRefreshInterval;
	}

	public void setReservoirRefreshInterval(Duration reservoirRefreshInterval) {
		this.reservoirRefreshInterval = reservoirRefreshInterval;
	}

	public int getLimiterMaxRetries() {
		return limiterMaxRetries;
	}

	public void setLimiterMaxRetries(int limiterMaxRetries) {
		this.limiterMaxRetries = limiterMaxRetries;
	}

	public Duration getLimiterInitialBackoff() {
		return limiterInitialBackoff;
	}

	public void setLimiterInitialBackoff(Duration limiterInitialBackoff) {
		this.limiterInitialBackoff = limiterInitialBackoff;
	}

	public int getLowQuotaWarningPercent() {
		return lowQuotaWarningPercent;
	}

	public void setLowQuotaWarningPercent(int lowQuotaWarningPercent) {
		this.lowQuotaWarningPercent = lowQuotaWarningPercent;
	}

	public int getCriticalRemainingThreshold() {
		return criticalRemainingThreshold;
	}

	public void setCriticalRemainingThreshold(int criticalRemainingThreshold) {
		this.criticalRemainingThreshold = criticalRemainingThreshold;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	public int getMaxPullRequests() {
		return maxPullRequests;
	}

	public void setMaxPullRequests(int maxPullRequests) {
		this.maxPullRequests = maxPullRequests;
	}

	public int getMaxIssues() {
		return maxIssues;
	}

	public void setMaxIssues(int maxIssues) {
		this.maxIssues = maxIssues;
	}

	public int getMaxCommits() {
		return maxCommits;
	}

	public void setMaxCommits(int maxCommits) {
		this.maxCommits = maxCommits;
	}

	public int getMaxBranches() {
		return maxBranches;
	}

	public void setMaxBranches(int maxBranches) {
		this.maxBranches = maxBranches;
	}

	public int getMaxReleases() {
		return maxReleases;
	}

	public void setMaxReleases(int maxReleases) {
		this.maxReleases = maxReleases;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public boolean isCacheEnabled() {
		return cacheEnabled;
	}

	public void setCacheEnabled(boolean cacheEnabled) {
		this.cacheEnabled = cacheEnabled;
	}

	public Path getCacheDirectory() {
		return cacheDirectory;
	}

	public void setCacheDirectory(Path cacheDirectory) {
		this.cacheDirectory = cacheDirectory;
	}

	public Duration getCacheTtl() {
		return cacheTtl;
	}

	public void setCacheTtl(Duration cacheTtl) {
		this.cacheTtl = cacheTtl;
	}

	public long getMemoryCacheMaxBytes() {
		return memoryCacheMaxBytes;
	}

	public void setMemoryCacheMaxBytes(long memoryCacheMaxBytes) {
		this.memoryCacheMaxBytes = memoryCacheMaxBytes;
	}

	public Duration getMemoryCacheTtl() {
		return memoryCacheTtl;
	}

	public void setMemoryCacheTtl(Duration memoryCacheTtl) {
		this.memoryCacheTtl = memoryCacheTtl;
	}

	public String getMemoryCacheEvictionPolicy() {
		return memoryCacheEvictionPolicy;
	}

	public void setMemoryCacheEvictionPolicy(String memoryCacheEvictionPolicy) {
		this.memoryCacheEvictionPolicy = memoryCacheEvictionPolicy;
	}

	public Duration getMemoryCacheSweepInterval() {
		return memoryCacheSweepInterval;
	}

	public void setMemoryCacheSweepInterval(Duration memoryCacheSweepInterval) {
		this.memoryCacheSweepInterval = memoryCacheSweepInterval;
	}

	public Path getStateFile() {
		return stateFile;
	}

	public void setStateFile(Path stateFile) {
		this.stateFile = stateFile;
	}

	public int getDefaultParallelism() {
		return defaultParallelism;
	}

	public void setDefaultParallelism(int defaultParallelism) {
		this.defaultParallelism = defaultParallelism;
	}

	public Path getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(Path outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

}
