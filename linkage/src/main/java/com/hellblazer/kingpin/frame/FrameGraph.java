/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kingpin.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kingpin.frame;

import com.hellblazer.kingpin.exceptions.FrameNotFoundException;
import com.hellblazer.kingpin.exceptions.GraphConstructionException;
import com.hellblazer.kingpin.geometry.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A fixed topology tree of named coordinate frames. Frames are held in an arena indexed by declaration order; each
 * frame keeps a parent index and its children. Points are carried between any two frames by walking the precomputed
 * {@link PathTable} and applying one rigid transform per hop.
 *
 * <p>Not thread safe: the graph is mutated in place while a design is solved.
 *
 * @author hal.hildebrand
 */
public final class FrameGraph {
    private static final Logger log = LoggerFactory.getLogger(FrameGraph.class);

    private final List<Frame>          frames;
    private final Map<String, Integer> index;
    private final PathTable            paths;

    private FrameGraph(List<Frame> frames, Map<String, Integer> index, PathTable paths) {
        this.frames = frames;
        this.index = index;
        this.paths = paths;
    }

    /**
     * Construct a frame graph. Every non-root frame must name an existing parent, exactly one root must exist, and the
     * parent links must be acyclic. Declaration order is free.
     *
     * @param descriptors frame descriptions
     * @return the frame graph
     * @throws GraphConstructionException if the topology is not a singly rooted tree
     */
    public static FrameGraph build(List<FrameDescriptor> descriptors) {
        if (descriptors.isEmpty()) {
            throw new GraphConstructionException("Frame graph requires at least one frame");
        }
        var index = new HashMap<String, Integer>();
        for (int i = 0; i < descriptors.size(); i++) {
            var name = descriptors.get(i).name();
            if (name == null || name.isEmpty()) {
                throw new GraphConstructionException("Frame " + i + " has no name");
            }
            if (index.putIfAbsent(name, i) != null) {
                throw new GraphConstructionException("Duplicate frame name: " + name);
            }
        }

        var parents = new int[descriptors.size()];
        var root = Frame.NO_PARENT;
        for (int i = 0; i < descriptors.size(); i++) {
            var descriptor = descriptors.get(i);
            if (descriptor.isRoot()) {
                if (root != Frame.NO_PARENT) {
                    throw new GraphConstructionException(
                    "Multiple root frames: " + descriptors.get(root).name() + ", " + descriptor.name());
                }
                root = i;
                parents[i] = Frame.NO_PARENT;
            } else {
                var parent = index.get(descriptor.parent());
                if (parent == null) {
                    throw new GraphConstructionException(
                    "Frame " + descriptor.name() + " declares unknown parent " + descriptor.parent());
                }
                parents[i] = parent;
            }
        }
        if (root == Frame.NO_PARENT) {
            throw new GraphConstructionException("Frame graph has no root frame");
        }
        for (int i = 0; i < parents.length; i++) {
            var steps = 0;
            for (int node = i; parents[node] != Frame.NO_PARENT; node = parents[node]) {
                if (++steps > parents.length) {
                    throw new GraphConstructionException(
                    "Frame " + descriptors.get(i).name() + " is part of a parent cycle");
                }
            }
        }

        var frames = new ArrayList<Frame>(descriptors.size());
        for (int i = 0; i < descriptors.size(); i++) {
            frames.add(new Frame(i, descriptors.get(i), parents[i]));
        }
        for (var frame : frames) {
            if (!frame.isRoot()) {
                frames.get(frame.getParent()).addChild(frame.getIndex());
            }
        }

        log.debug("Built frame graph of {} frames rooted at {}", frames.size(), frames.get(root).getName());
        return new FrameGraph(Collections.unmodifiableList(frames), Collections.unmodifiableMap(index),
                              PathTable.fromParents(parents));
    }

    /**
     * @throws FrameNotFoundException if the frame does not exist
     */
    public int indexOf(String frameName) {
        var i = index.get(frameName);
        if (i == null) {
            throw new FrameNotFoundException("Frame " + frameName + " does not exist");
        }
        return i;
    }

    /**
     * @throws FrameNotFoundException if the frame does not exist
     */
    public Frame getFrame(String frameName) {
        return frames.get(indexOf(frameName));
    }

    /**
     * @throws FrameNotFoundException if the index is out of range
     */
    public Frame getFrame(int frameIndex) {
        if (frameIndex < 0 || frameIndex >= frames.size()) {
            throw new FrameNotFoundException("Frame index " + frameIndex + " out of range [0, " + frames.size() + ")");
        }
        return frames.get(frameIndex);
    }

    public boolean hasFrame(String frameName) {
        return index.containsKey(frameName);
    }

    /**
     * @return frames in declaration order
     */
    public List<Frame> getFrames() {
        return frames;
    }

    public PathTable getPaths() {
        return paths;
    }

    public int size() {
        return frames.size();
    }

    /**
     * @return the frame names visited from {@code source} to {@code target}, both inclusive
     */
    public List<String> path(String source, String target) {
        var names = new ArrayList<String>();
        for (var i : paths.path(indexOf(source), indexOf(target))) {
            names.add(frames.get(i).getName());
        }
        return names;
    }

    /**
     * Evaluate a named point of {@code source} in the coordinates of {@code target}.
     *
     * @param pointName point of interest of the source frame
     * @param source    frame owning the point
     * @param target    frame to express the point in
     * @return the point in target coordinates
     * @throws FrameNotFoundException if either frame does not exist
     * @throws com.hellblazer.kingpin.exceptions.PointNotFoundException if the point is absent from the source frame
     */
    public Point3d evaluatePoint(String pointName, String source, String target) {
        var from = indexOf(source);
        var to = indexOf(target);
        return carry(frames.get(from).getPoint(pointName).getPosition(), from, to);
    }

    /**
     * Evaluate a literal coordinate expressed in {@code source} in the coordinates of {@code target}.
     *
     * @throws FrameNotFoundException if either frame does not exist
     */
    public Point3d evaluatePoint(Point3d point, String source, String target) {
        return carry(new Point3d(point), indexOf(source), indexOf(target));
    }

    /**
     * Batch form of {@link #evaluatePoint(Point3d, String, String)}.
     */
    public List<Point3d> evaluatePoints(List<Point3d> points, String source, String target) {
        var to = indexOf(target);
        var current = indexOf(source);
        var result = new ArrayList<Point3d>(points.size());
        for (var p : points) {
            result.add(new Point3d(p));
        }
        while (current != to) {
            var next = paths.next(current, to);
            result = new ArrayList<>(hop(result, current, next));
            current = next;
        }
        return result;
    }

    /**
     * Convert {@code value}, expressed in {@code source}, into the local coordinates of {@code frame} and overwrite the
     * named point there.
     *
     * @return the value written, in {@code frame} coordinates
     * @throws FrameNotFoundException if either frame does not exist
     * @throws com.hellblazer.kingpin.exceptions.PointNotFoundException if the point is absent from {@code frame}
     */
    public Point3d setPoint(String pointName, String frame, Point3d value, String source) {
        var target = getFrame(frame);
        var local = evaluatePoint(value, source, frame);
        target.setPoint(pointName, local);
        return local;
    }

    private Point3d carry(Point3d point, int from, int to) {
        var current = from;
        var p = point;
        while (current != to) {
            var next = paths.next(current, to);
            p = hop(List.of(p), current, next).get(0);
            current = next;
        }
        return p;
    }

    private List<Point3d> hop(List<Point3d> points, int current, int next) {
        var nextFrame = frames.get(next);
        if (nextFrame.getParent() == current) {
            // parent -> child
            return Transforms.forwardTransform(points, nextFrame.getRotation(), nextFrame.getPosition());
        }
        var currentFrame = frames.get(current);
        return Transforms.reverseTransform(points, currentFrame.getRotation(), currentFrame.getPosition());
    }
}
