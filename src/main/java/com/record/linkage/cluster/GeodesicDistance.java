package com.record.linkage.cluster;

import com.record.linkage.geo.Coordinates;

/**
 * Great-circle distance on a spherical Earth (haversine formula).
 */
public final class GeodesicDistance {

    /** Mean Earth radius in statute miles. */
    public static final double EARTH_RADIUS_MILES = 3958.7613;

    private GeodesicDistance() {
    }

    public static double miles(Coordinates a, Coordinates b) {
        return miles(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * @return the distance between the two points in miles; coordinates in decimal degrees
     */
    public static double miles(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }
}
