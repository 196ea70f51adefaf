package com.invoice.mapping.model;

import lombok.Value;

import java.util.List;

@Value
public class BoundingBox {
    double x;
    double y;
    double width;
    double height;

    /**
     * Axis-aligned box around a flat x,y polygon. Null for an empty or odd-length polygon.
     */
    public static BoundingBox fromPolygon(List<Double> polygon) {
        if (polygon == null || polygon.size() < 4 || polygon.size() % 2 != 0) {
            return null;
        }
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (int i = 0; i < polygon.size(); i += 2) {
            double px = polygon.get(i);
            double py = polygon.get(i + 1);
            minX = Math.min(minX, px);
            maxX = Math.max(maxX, px);
            minY = Math.min(minY, py);
            maxY = Math.max(maxY, py);
        }
        return new BoundingBox(minX, minY, maxX - minX, maxY - minY);
    }
}
