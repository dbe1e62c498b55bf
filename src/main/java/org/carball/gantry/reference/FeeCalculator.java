package org.carball.gantry.reference;

import org.carball.gantry.model.condition.VehicleCategory;

/**
 * Closed-form toll tariff: charged kilometers times the per-class rate, in cents.
 */
public class FeeCalculator {

    private final ReferenceTables tables;

    public FeeCalculator(ReferenceTables tables) {
        this.tables = tables;
    }

    /**
     * Rate in yuan per kilometer. Passenger classes have their own rate; trucks and special
     * vehicles share the blended truck rate.
     */
    public double ratePerKm(long vehicleType) {
        if (VehicleCategory.PASSENGER.contains(vehicleType)) {
            Double rate = tables.getTollRates().getPassenger().get((int) vehicleType);
            return rate != null ? rate : tables.getTollRates().getPassenger().values().iterator().next();
        }
        return tables.getTollRates().truckBlended();
    }

    public long expectedFee(long vehicleType, long mileageMeters) {
        return (long) (mileageMeters / 1000.0 * ratePerKm(vehicleType) * 100);
    }

    /**
     * Expected fee per meter, in cents.
     */
    public double centsPerMeter(long vehicleType) {
        return ratePerKm(vehicleType) / 10.0;
    }

    public long etcDiscount(long payFee) {
        return (long) (payFee * tables.getEtcDiscountRate());
    }
}
