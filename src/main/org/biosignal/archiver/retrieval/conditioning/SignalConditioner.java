package org.biosignal.archiver.retrieval.conditioning;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.retrieval.ChannelSeries;

/**
 * Applies the optional device specific filter and then a normalizer to each channel of a query result.
 * Each conditioned value stays paired with its original timestamp.
 * @author mshankar
 *
 */
public class SignalConditioner {
	private static final Logger logger = LogManager.getLogger(SignalConditioner.class.getName());
	public static final String PERCENTILE_LOWER_PROPERTY = "org.biosignal.archiver.conditioning.percentile.lower";
	public static final String PERCENTILE_UPPER_PROPERTY = "org.biosignal.archiver.conditioning.percentile.upper";

	private final SignalFilter filter;
	private final double defaultLowerPercentile;
	private final double defaultUpperPercentile;

	public SignalConditioner(ConfigService configService) {
		this.filter = new SignalFilter(configService);
		this.defaultLowerPercentile = configService.getDoubleProperty(PERCENTILE_LOWER_PROPERTY, 5);
		this.defaultUpperPercentile = configService.getDoubleProperty(PERCENTILE_UPPER_PROPERTY, 95);
	}

	public SignalFilter getFilter() {
		return filter;
	}

	public Normalizer resolveNormalizer(String normalizerUserArg) {
		Normalizer normalizer = Normalizers.findNormalizer(normalizerUserArg);
		if(normalizer instanceof PercentileNormalizer && PercentileNormalizer.IDENTITY.equals(normalizerUserArg)) {
			((PercentileNormalizer) normalizer).setPercentiles(defaultLowerPercentile, defaultUpperPercentile);
		}
		return normalizer;
	}

	public double[] condition(double[] values, ConditioningRequest request, Normalizer normalizer) {
		double[] ret = values;
		if(request.isFilteringRequested()) {
			ret = request.isZeroPhase()
					? filter.zeroPhase(ret, request.getDeviceType(), request.getSampleRate())
					: filter.filterByDeviceType(ret, request.getDeviceType(), request.getSampleRate());
		}
		if(normalizer != null) {
			ret = normalizer.normalize(ret);
		}
		return ret;
	}

	/**
	 * Condition every channel.
	 * @param channels Channel number to series; not modified
	 * @param request ConditioningRequest
	 * @return Channel number to conditioned series, in the same order
	 */
	public Map<Integer, ChannelSeries> conditionChannels(Map<Integer, ChannelSeries> channels, ConditioningRequest request) {
		Normalizer normalizer = request.getNormalizer() == null ? null : resolveNormalizer(request.getNormalizer());
		logger.debug("Conditioning " + channels.size() + " channels with " + request);
		LinkedHashMap<Integer, ChannelSeries> ret = new LinkedHashMap<Integer, ChannelSeries>();
		for(Map.Entry<Integer, ChannelSeries> entry : channels.entrySet()) {
			ChannelSeries series = entry.getValue();
			ret.put(entry.getKey(), series.withValues(condition(series.getValues(), request, normalizer)));
		}
		return ret;
	}

	public static Map<Integer, SeriesStats> computeStats(Map<Integer, ChannelSeries> channels) {
		LinkedHashMap<Integer, SeriesStats> ret = new LinkedHashMap<Integer, SeriesStats>();
		for(Map.Entry<Integer, ChannelSeries> entry : channels.entrySet()) {
			ret.put(entry.getKey(), SeriesStats.compute(entry.getValue().getValues()));
		}
		return ret;
	}
}
