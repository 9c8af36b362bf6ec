package de.uni_passau.fluxbench.workload.iot;

import de.uni_passau.fluxbench.workload.QueryGenerator;
import de.uni_passau.fluxbench.workload.WorkloadException;
import de.uni_passau.fluxbench.workload.query.impl.Query;

/**
 * Query types of the IoT use case. Every method fills exactly one empty query.
 */
public interface IotQueries extends QueryGenerator {

  void lastLocByTruck(Query query, int nTrucks) throws WorkloadException;

  void lastLocPerTruck(Query query);

  void trucksWithLowFuel(Query query);

  void trucksWithHighLoad(Query query);

  void stationaryTrucks(Query query) throws WorkloadException;

  void trucksWithLongDrivingSessions(Query query) throws WorkloadException;

  void trucksWithLongDailySessions(Query query) throws WorkloadException;

  void avgVsProjectedFuelConsumption(Query query);

  void avgDailyDrivingDuration(Query query);

  void avgDailyDrivingSession(Query query);

  void avgLoad(Query query);

  void dailyTruckActivity(Query query);

  void truckBreakdownFrequency(Query query);
}
