package org.biosignal.archiver.engine;

import java.util.HashMap;

/**
 * The device information that comes with each upload batch.
 */
public class DeviceInfo {
	private String name;
	private String address;

	public DeviceInfo() {
	}

	public DeviceInfo(String name, String address) {
		this.name = name;
		this.address = address;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getAddress() {
		return address;
	}

	public void setAddress(String address) {
		this.address = address;
	}

	/**
	 * @return The non null fields as a map suitable for merging into the session's device metadata.
	 */
	public HashMap<String, String> toMap() {
		HashMap<String, String> ret = new HashMap<String, String>();
		if(name != null) ret.put("name", name);
		if(address != null) ret.put("address", address);
		return ret;
	}
}
