package com.wangbin.meshinfo.common.utils;

/**
 * 经纬度计算工具类
 */
public class GeoUtil {

    /** 地球半径（公里），近似值 */
    private static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtil() {
        // 工具类，防止实例化
    }

    /**
     * 两点间距离（公里，haversine），保留3位小数
     */
    public static double distance(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double lonDelta = Math.toRadians(lon2 - lon1);

        double d = 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(
                hav(phi2 - phi1) + Math.cos(phi1) * Math.cos(phi2) * hav(lonDelta)));
        return round(d, 3);
    }

    /**
     * 初始方位角（度），保留1位小数，结果在 [0, 360)
     */
    public static double bearing(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double lonDelta = Math.toRadians(lon2 - lon1);

        double b = Math.atan2(
                Math.sin(lonDelta) * Math.cos(phi2),
                Math.cos(phi1) * Math.sin(phi2) - Math.sin(phi1) * Math.cos(phi2) * Math.cos(lonDelta));
        return normalizeBearing(round(Math.toDegrees(b), 1));
    }

    /**
     * 将角度规范到 [0, 360)
     */
    public static double normalizeBearing(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        // 舍入后可能出现 360.0
        if (normalized >= 360.0) {
            normalized -= 360.0;
        }
        // 去掉 -0.0
        return normalized + 0.0;
    }

    private static double hav(double theta) {
        return Math.pow(Math.sin(theta / 2), 2);
    }

    private static double round(double value, int scale) {
        double factor = Math.pow(10, scale);
        return Math.round(value * factor) / factor;
    }
}
