package com.geometry.deduction.core.model;

import com.geometry.deduction.construction.ConstructionLayer;
import com.geometry.deduction.registry.ChangeListener;
import com.geometry.deduction.registry.RegisteredObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A ray from a vertex through the farthest known point of its line in that direction.
 * When its line gains points the ray re-targets itself and may merge with an
 * equivalent ray.
 */
public class Ray extends RegisteredObject implements ChangeListener {

    private final ConstructionLayer layer;
    private final Point vertex;
    private Point pointingTo;

    public Ray(ConstructionLayer layer, Point vertex, Point pointingTo) {
        super(keyOf(vertex, pointingTo));
        this.layer = layer;
        this.vertex = vertex;
        this.pointingTo = pointingTo;
    }

    public static String keyOf(Point vertex, Point pointingTo) {
        return vertex.getKey() + " " + pointingTo.getKey();
    }

    @Override
    public ObjectKind kind() {
        return ObjectKind.RAY;
    }

    public Point getVertex() {
        return self().vertex;
    }

    public Point getPointingTo() {
        return self().pointingTo;
    }

    public Line line() {
        Ray live = self();
        return layer.line(List.of(live.vertex, live.pointingTo));
    }

    /** Known points of the line past the vertex, nearest first. */
    public List<Point> pointsBeyondVertex() {
        Ray live = self();
        List<Point> linePoints = new ArrayList<>(line().getPoints());
        if (linePoints.indexOf(live.vertex) > linePoints.indexOf(live.pointingTo)) {
            Collections.reverse(linePoints);
        }
        return new ArrayList<>(linePoints.subList(linePoints.indexOf(live.vertex) + 1, linePoints.size()));
    }

    @Override
    public void onChange(RegisteredObject source, RegisteredObject replacement) {
        requireLive("re-target ray");
        pointingTo = layer.canonicalRayDirectionPoint(vertex, pointingTo);
        line().addChangeListener(this);
        layer.registry().updateKey(this, keyOf(vertex, pointingTo));
    }

    @Override
    protected List<Object> identity() {
        return List.of(vertex, pointingTo);
    }

    private Ray self() {
        return (Ray) live();
    }

    @Override
    public String toString() {
        return "Ray(" + getKey() + ")";
    }
}
