package org.hypertrace.alerting.evaluator.datasource;

import java.util.List;
import lombok.Value;
import org.apache.commons.lang3.tuple.Pair;
import org.hypertrace.alerting.datamodel.Labels;

/** A labeled series of <epoch millis, value> points returned by a data source. */
@Value
public class TimeSeries {
  Labels labels;
  List<Pair<Long, Double>> points;
}
