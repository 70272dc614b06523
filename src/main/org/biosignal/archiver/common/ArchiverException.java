/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.biosignal.archiver.common;


/**
 * Base class for the conditions the ingestion, consolidation and retrieval components report to their callers.
 * The {@link ResultCode} lets the service boundary translate the exception into a structured result.
 * @author mshankar
 *
 */
public class ArchiverException extends Exception {
	private static final long serialVersionUID = -8779828706258704029L;
	private final ResultCode code;

	public ArchiverException(ResultCode code, String msg) {
		super(msg);
		this.code = code;
	}

	public ArchiverException(ResultCode code, String msg, Throwable cause) {
		super(msg, cause);
		this.code = code;
	}

	public ResultCode getCode() {
		return code;
	}
}
