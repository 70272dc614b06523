package org.biosignal.archiver.config;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.biosignal.archiver.common.TimeUtils;
import org.biosignal.archiver.data.DataChunk;
import org.json.simple.JSONObject;

/**
 * Everything we know about one continuous recording.
 * The ingestion side owns the session while it is active; once finalized it is read mostly.
 * Sessions are persisted as JSON strings by the {@link SessionPersistence} implementations.
 * @author mshankar
 *
 */
public class SessionInfo {
	public static final int DEFAULT_SAMPLE_RATE = 1000;

	private String sessionId;
	private String userId;
	private String deviceId;
	private String deviceName;
	private DeviceType deviceType = DeviceType.UNKNOWN;
	private String sessionType = "raw";
	private int sampleRate = DEFAULT_SAMPLE_RATE;
	private int channelCount = DataChunk.CHANNEL_COUNT;
	private long totalSamples = 0;
	private SessionStatus status = SessionStatus.ACTIVE;
	private Instant startTime;
	private Instant endTime;
	private Instant creationTime;
	private String appVersion = "";
	private String notes = "";
	private String errorMessage;
	private HashMap<String, String> deviceMetadata = new HashMap<String, String>();

	public SessionInfo() {
	}

	public SessionInfo(String sessionId, String userId, String deviceId, String deviceName, DeviceType deviceType, Instant startTime) {
		this.sessionId = sessionId;
		this.userId = userId;
		this.deviceId = deviceId;
		this.deviceName = deviceName;
		this.deviceType = deviceType == null ? DeviceType.UNKNOWN : deviceType;
		this.startTime = startTime;
		this.creationTime = TimeUtils.now();
	}

	/**
	 * Copy constructor; the in memory persistence hands out copies so that callers cannot change stored state behind its back.
	 * @param other SessionInfo
	 */
	public SessionInfo(SessionInfo other) {
		this.sessionId = other.sessionId;
		this.userId = other.userId;
		this.deviceId = other.deviceId;
		this.deviceName = other.deviceName;
		this.deviceType = other.deviceType;
		this.sessionType = other.sessionType;
		this.sampleRate = other.sampleRate;
		this.channelCount = other.channelCount;
		this.totalSamples = other.totalSamples;
		this.status = other.status;
		this.startTime = other.startTime;
		this.endTime = other.endTime;
		this.creationTime = other.creationTime;
		this.appVersion = other.appVersion;
		this.notes = other.notes;
		this.errorMessage = other.errorMessage;
		this.deviceMetadata = new HashMap<String, String>(other.deviceMetadata);
	}

	public boolean isActive() {
		return status == SessionStatus.ACTIVE;
	}

	public boolean isOwnedBy(String principal) {
		return userId != null && userId.equals(principal);
	}

	/**
	 * @return Duration of the session in seconds or null if the session has not ended.
	 */
	public Long getDurationSeconds() {
		if(startTime == null || endTime == null) return null;
		return (endTime.toEpochMilli() - startTime.toEpochMilli()) / 1000;
	}

	public void addSamples(long count) {
		this.totalSamples += count;
	}

	/**
	 * Merge the device information that comes in with each batch.
	 * A device name in the batch replaces the one from session creation.
	 * @param info Key/value pairs; may be null
	 */
	public void mergeDeviceInfo(Map<String, String> info) {
		if(info == null) return;
		String name = info.get("name");
		if(name != null && !name.isEmpty()) {
			this.deviceName = name;
		}
		deviceMetadata.putAll(info);
	}

	public void markCompleted(Instant endTime, long totalSamples) {
		this.status = SessionStatus.COMPLETED;
		this.endTime = endTime;
		this.totalSamples = totalSamples;
	}

	public void markAsError(String errorMessage) {
		this.status = SessionStatus.ERROR;
		this.errorMessage = errorMessage;
	}

	public String getSessionId() {
		return sessionId;
	}

	public void setSessionId(String sessionId) {
		this.sessionId = sessionId;
	}

	public String getUserId() {
		return userId;
	}

	public void setUserId(String userId) {
		this.userId = userId;
	}

	public String getDeviceId() {
		return deviceId;
	}

	public void setDeviceId(String deviceId) {
		this.deviceId = deviceId;
	}

	public String getDeviceName() {
		return deviceName;
	}

	public void setDeviceName(String deviceName) {
		this.deviceName = deviceName;
	}

	public DeviceType getDeviceType() {
		return deviceType;
	}

	public void setDeviceType(DeviceType deviceType) {
		this.deviceType = deviceType;
	}

	public String getSessionType() {
		return sessionType;
	}

	public void setSessionType(String sessionType) {
		this.sessionType = sessionType;
	}

	public int getSampleRate() {
		return sampleRate;
	}

	public void setSampleRate(int sampleRate) {
		this.sampleRate = sampleRate;
	}

	public int getChannelCount() {
		return channelCount;
	}

	public void setChannelCount(int channelCount) {
		this.channelCount = channelCount;
	}

	public long getTotalSamples() {
		return totalSamples;
	}

	public void setTotalSamples(long totalSamples) {
		this.totalSamples = totalSamples;
	}

	public SessionStatus getStatus() {
		return status;
	}

	public void setStatus(SessionStatus status) {
		this.status = status;
	}

	public Instant getStartTime() {
		return startTime;
	}

	public void setStartTime(Instant startTime) {
		this.startTime = startTime;
	}

	public Instant getEndTime() {
		return endTime;
	}

	public void setEndTime(Instant endTime) {
		this.endTime = endTime;
	}

	public Instant getCreationTime() {
		return creationTime;
	}

	public void setCreationTime(Instant creationTime) {
		this.creationTime = creationTime;
	}

	public String getAppVersion() {
		return appVersion;
	}

	public void setAppVersion(String appVersion) {
		this.appVersion = appVersion;
	}

	public String getNotes() {
		return notes;
	}

	public void setNotes(String notes) {
		this.notes = notes;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public HashMap<String, String> getDeviceMetadata() {
		return deviceMetadata;
	}

	@SuppressWarnings("unchecked")
	public JSONObject toJSON() {
		JSONObject ret = new JSONObject();
		ret.put("sessionId", sessionId);
		ret.put("userId", userId);
		ret.put("deviceId", deviceId);
		ret.put("deviceName", deviceName);
		ret.put("deviceType", deviceType.getExternalName());
		ret.put("sessionType", sessionType);
		ret.put("sampleRate", sampleRate);
		ret.put("channelCount", channelCount);
		ret.put("totalSamples", totalSamples);
		ret.put("status", status.getExternalName());
		ret.put("startTime", startTime == null ? null : TimeUtils.convertToISO8601String(startTime));
		ret.put("endTime", endTime == null ? null : TimeUtils.convertToISO8601String(endTime));
		ret.put("creationTime", creationTime == null ? null : TimeUtils.convertToISO8601String(creationTime));
		ret.put("duration", getDurationSeconds());
		ret.put("appVersion", appVersion);
		ret.put("notes", notes);
		if(errorMessage != null) {
			ret.put("error", errorMessage);
		}
		JSONObject deviceInfo = new JSONObject();
		deviceInfo.putAll(deviceMetadata);
		ret.put("deviceInfo", deviceInfo);
		return ret;
	}

	public static SessionInfo fromJSON(JSONObject jsonObj) {
		SessionInfo info = new SessionInfo();
		info.sessionId = (String) jsonObj.get("sessionId");
		info.userId = (String) jsonObj.get("userId");
		info.deviceId = (String) jsonObj.get("deviceId");
		info.deviceName = (String) jsonObj.get("deviceName");
		info.deviceType = DeviceType.fromExternalName((String) jsonObj.get("deviceType"));
		if(jsonObj.get("sessionType") != null) info.sessionType = (String) jsonObj.get("sessionType");
		if(jsonObj.get("sampleRate") != null) info.sampleRate = ((Number) jsonObj.get("sampleRate")).intValue();
		if(jsonObj.get("channelCount") != null) info.channelCount = ((Number) jsonObj.get("channelCount")).intValue();
		if(jsonObj.get("totalSamples") != null) info.totalSamples = ((Number) jsonObj.get("totalSamples")).longValue();
		if(jsonObj.get("status") != null) info.status = SessionStatus.fromExternalName((String) jsonObj.get("status"));
		info.startTime = parseInstant(jsonObj.get("startTime"));
		info.endTime = parseInstant(jsonObj.get("endTime"));
		info.creationTime = parseInstant(jsonObj.get("creationTime"));
		if(jsonObj.get("appVersion") != null) info.appVersion = (String) jsonObj.get("appVersion");
		if(jsonObj.get("notes") != null) info.notes = (String) jsonObj.get("notes");
		info.errorMessage = (String) jsonObj.get("error");
		Object deviceInfo = jsonObj.get("deviceInfo");
		if(deviceInfo instanceof JSONObject) {
			for(Object key : ((JSONObject) deviceInfo).keySet()) {
				Object value = ((JSONObject) deviceInfo).get(key);
				info.deviceMetadata.put(key.toString(), value == null ? null : value.toString());
			}
		}
		return info;
	}

	private static Instant parseInstant(Object val) {
		if(val == null) return null;
		return TimeUtils.convertFromISO8601String(val.toString());
	}

	@Override
	public String toString() {
		return "Session " + sessionId + " (" + status.getExternalName() + ", " + totalSamples + " samples)";
	}
}
