package org.biosignal.archiver.config;

/**
 * The class of peripheral a session is recorded from.
 * The device type selects the bandpass used when conditioning the signal on retrieval.
 * @author mshankar
 *
 */
public enum DeviceType {
	/** Surface electromyography; 20 to 400 Hz */
	SEMG("sEMG", 20.0, 400.0),
	/** Inertial measurement unit; 0.5 to 20 Hz */
	IMU("IMU", 0.5, 20.0),
	UNKNOWN("unknown", Double.NaN, Double.NaN);

	private final String externalName;
	private final double defaultLowCut;
	private final double defaultHighCut;

	private DeviceType(String externalName, double defaultLowCut, double defaultHighCut) {
		this.externalName = externalName;
		this.defaultLowCut = defaultLowCut;
		this.defaultHighCut = defaultHighCut;
	}

	public String getExternalName() {
		return externalName;
	}

	public double getDefaultLowCut() {
		return defaultLowCut;
	}

	public double getDefaultHighCut() {
		return defaultHighCut;
	}

	/**
	 * Map a device type as sent by clients; the HC-05 bluetooth bridge only ships with sEMG front ends.
	 * Anything we do not recognize is UNKNOWN.
	 * @param name Device type as a string; may be null
	 * @return DeviceType
	 */
	public static DeviceType fromExternalName(String name) {
		if(name == null) return UNKNOWN;
		if(name.equalsIgnoreCase("HC-05")) return SEMG;
		for(DeviceType type : DeviceType.values()) {
			if(type.externalName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
				return type;
			}
		}
		return UNKNOWN;
	}
}
