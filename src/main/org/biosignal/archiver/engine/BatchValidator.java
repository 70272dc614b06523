package org.biosignal.archiver.engine;

import java.util.LinkedList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.common.BatchIntegrityException;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.data.Sample;

/**
 * Checks the integrity of an upload batch before anything is persisted.
 * All the problems with a batch are collected and reported together.
 * <ul>
 * <li>The batch must have samples, and no more than <code>maxSamplesPerBatch</code>.</li>
 * <li>The declared size must match the number of samples.</li>
 * <li>Every sample must name the batch's session, have a positive timestamp and finite values.</li>
 * <li>The first and last timestamps must be within <code>timestampToleranceMillis</code> of the declared start and end.</li>
 * </ul>
 * @author mshankar
 *
 */
public class BatchValidator {
	private static final Logger logger = LogManager.getLogger(BatchValidator.class.getName());
	public static final String TIMESTAMP_TOLERANCE_PROPERTY = "org.biosignal.archiver.engine.timestampToleranceMillis";
	public static final String PAD_SHORT_VECTORS_PROPERTY = "org.biosignal.archiver.engine.padShortChannelVectors";
	public static final String MAX_SAMPLES_PROPERTY = "org.biosignal.archiver.engine.maxSamplesPerBatch";
	public static final long DEFAULT_TIMESTAMP_TOLERANCE_MILLIS = 10;
	public static final int DEFAULT_MAX_SAMPLES_PER_BATCH = 5000;
	/** We stop listing value problems after this many; the batch is rejected anyway. */
	private static final int MAX_REPORTED_VALUE_ERRORS = 10;

	private final long timestampToleranceMillis;
	private final boolean padShortVectors;
	private final int maxSamplesPerBatch;

	public BatchValidator(ConfigService configService) {
		this.timestampToleranceMillis = configService.getLongProperty(TIMESTAMP_TOLERANCE_PROPERTY, DEFAULT_TIMESTAMP_TOLERANCE_MILLIS);
		this.padShortVectors = configService.getBooleanProperty(PAD_SHORT_VECTORS_PROPERTY, true);
		this.maxSamplesPerBatch = configService.getIntProperty(MAX_SAMPLES_PROPERTY, DEFAULT_MAX_SAMPLES_PER_BATCH);
	}

	public void validate(UploadBatch batch) throws BatchIntegrityException {
		List<String> errors = new LinkedList<String>();
		if(batch.getSessionId() == null || batch.getSessionId().isEmpty()) {
			errors.add("Batch does not have a session id");
		}
		List<Sample> samples = batch.getSamples();
		if(samples == null || samples.isEmpty()) {
			errors.add("Batch does not have any samples");
			throw new BatchIntegrityException(errors);
		}
		if(samples.size() > maxSamplesPerBatch) {
			errors.add("Batch has " + samples.size() + " samples; the maximum is " + maxSamplesPerBatch);
		}

		BatchInfo batchInfo = batch.getBatchInfo();
		if(batchInfo == null) {
			errors.add("Batch does not have batch info");
		} else {
			if(batchInfo.getSize() != samples.size()) {
				errors.add("Declared batch size " + batchInfo.getSize() + " does not match the number of samples " + samples.size());
			}
			long firstTs = samples.get(0).getTimestamp();
			long lastTs = samples.get(samples.size() - 1).getTimestamp();
			if(Math.abs(firstTs - batchInfo.getStartTime()) > timestampToleranceMillis) {
				errors.add("First sample timestamp " + firstTs + " does not match the declared start time " + batchInfo.getStartTime());
			}
			if(Math.abs(lastTs - batchInfo.getEndTime()) > timestampToleranceMillis) {
				errors.add("Last sample timestamp " + lastTs + " does not match the declared end time " + batchInfo.getEndTime());
			}
		}

		int valueErrors = 0;
		int i = 0;
		for(Sample sample : samples) {
			if(valueErrors >= MAX_REPORTED_VALUE_ERRORS) {
				errors.add("Skipping the remaining samples");
				break;
			}
			if(sample.getSessionId() != null && !sample.getSessionId().equals(batch.getSessionId())) {
				errors.add("Sample " + i + " is for session " + sample.getSessionId() + " but the batch is for " + batch.getSessionId());
				valueErrors++;
			}
			if(sample.getTimestamp() <= 0) {
				errors.add("Sample " + i + " has an invalid timestamp " + sample.getTimestamp());
				valueErrors++;
			}
			double[] values = sample.getValues();
			if(values == null) {
				errors.add("Sample " + i + " does not have values");
				valueErrors++;
			} else {
				if(!padShortVectors && values.length < DataChunk.CHANNEL_COUNT) {
					errors.add("Sample " + i + " has " + values.length + " values; expecting " + DataChunk.CHANNEL_COUNT);
					valueErrors++;
				}
				for(double value : values) {
					if(!Double.isFinite(value)) {
						errors.add("Sample " + i + " has a value that is not finite");
						valueErrors++;
						break;
					}
				}
			}
			i++;
		}

		if(!errors.isEmpty()) {
			logger.warn("Rejecting " + batch + " with " + errors.size() + " problems; the first is " + errors.get(0));
			throw new BatchIntegrityException(errors);
		}
	}
}
