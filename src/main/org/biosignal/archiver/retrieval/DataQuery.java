package org.biosignal.archiver.retrieval;

import org.biosignal.archiver.retrieval.conditioning.ConditioningRequest;

/**
 * A request for the data of one session.
 * Start and end are epoch milliseconds and may be null for an open range; a null channel list means all channels.
 * A null maxPoints means the configured default.
 */
public class DataQuery {
	private final String sessionId;
	private Long startTime;
	private Long endTime;
	private int[] channels;
	private Integer maxPoints;
	private ConditioningRequest conditioning;

	public DataQuery(String sessionId) {
		this.sessionId = sessionId;
	}

	public DataQuery withTimeRange(Long startTime, Long endTime) {
		this.startTime = startTime;
		this.endTime = endTime;
		return this;
	}

	public DataQuery withChannels(int[] channels) {
		this.channels = ChannelSelection.validate(channels);
		return this;
	}

	public DataQuery withChannels(String channelsArg) {
		this.channels = ChannelSelection.parse(channelsArg);
		return this;
	}

	public DataQuery withMaxPoints(Integer maxPoints) {
		this.maxPoints = maxPoints;
		return this;
	}

	public DataQuery withConditioning(ConditioningRequest conditioning) {
		this.conditioning = conditioning;
		return this;
	}

	public String getSessionId() {
		return sessionId;
	}

	public Long getStartTime() {
		return startTime;
	}

	public Long getEndTime() {
		return endTime;
	}

	public int[] getChannels() {
		return channels;
	}

	public Integer getMaxPoints() {
		return maxPoints;
	}

	public ConditioningRequest getConditioning() {
		return conditioning;
	}

	@Override
	public String toString() {
		return "DataQuery for " + sessionId + " from " + startTime + " to " + endTime;
	}
}
