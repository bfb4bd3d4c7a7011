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
package com.hellblazer.kingpin.linkage;

import javax.vecmath.Point3d;

/**
 * Vehicle level design intent, read only input to the solver. Lengths in millimetres, angles in radians, camber and
 * caster gains in radians per millimetre, roll and pitch center heights as percentages of the CG height.
 *
 * @param linkage                 linkage topology
 * @param axle                    axle the corner belongs to
 * @param wheelbase               wheelbase
 * @param frontWeightDistribution static front weight fraction
 * @param sprungMass              sprung mass in kilograms
 * @param cg                      center of gravity: longitudinal offset to the axle, lateral, height
 * @param rideHeight              static ride height
 * @param rake                    static rake angle
 * @param loadedRadius            tire loaded radius
 * @param track                   track width
 * @param toe                     static toe, positive out
 * @param caster                  static caster
 * @param casterGain              caster gain
 * @param pitchCenter             normalized pitch center height
 * @param camber                  static camber
 * @param camberGain              camber gain
 * @param rollCenter              normalized roll center height
 * @param scrub                   maximum mechanical scrub
 * @param kpi                     kingpin inclination
 * @param rideRatio               ride motion ratio target
 * @param arbRatio                anti-roll bar motion ratio target
 * @author hal.hildebrand
 */
public record Target(LinkageType linkage, Axle axle, double wheelbase, double frontWeightDistribution,
                     double sprungMass, Point3d cg, double rideHeight, double rake, double loadedRadius, double track,
                     double toe, double caster, double casterGain, double pitchCenter, double camber,
                     double camberGain, double rollCenter, double scrub, double kpi, double rideRatio,
                     double arbRatio) {

    public Target {
        cg = new Point3d(cg);
    }

    /**
     * @return a copy of the center of gravity
     */
    @Override
    public Point3d cg() {
        return new Point3d(cg);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LinkageType linkage                 = LinkageType.DOUBLE_WISHBONE;
        private Axle        axle                    = Axle.FRONT;
        private double      wheelbase;
        private double      frontWeightDistribution = 0.5;
        private double      sprungMass;
        private Point3d     cg;
        private double      cgHeight;
        private double      rideHeight;
        private double      rake;
        private double      loadedRadius;
        private double      track;
        private double      toe;
        private double      caster;
        private double      casterGain;
        private double      pitchCenter;
        private double      camber;
        private double      camberGain;
        private double      rollCenter;
        private double      scrub;
        private double      kpi;
        private double      rideRatio;
        private double      arbRatio;

        private Builder() {
        }

        public Builder linkage(LinkageType linkage) {
            this.linkage = linkage;
            return this;
        }

        public Builder axle(Axle axle) {
            this.axle = axle;
            return this;
        }

        public Builder wheelbase(double wheelbase) {
            this.wheelbase = wheelbase;
            return this;
        }

        public Builder frontWeightDistribution(double frontWeightDistribution) {
            this.frontWeightDistribution = frontWeightDistribution;
            return this;
        }

        public Builder sprungMass(double sprungMass) {
            this.sprungMass = sprungMass;
            return this;
        }

        /**
         * Explicit center of gravity; overrides the position derived from wheelbase, weight distribution and
         * {@link #cgHeight(double)}.
         */
        public Builder cg(double longitudinal, double lateral, double height) {
            this.cg = new Point3d(longitudinal, lateral, height);
            return this;
        }

        public Builder cgHeight(double cgHeight) {
            this.cgHeight = cgHeight;
            return this;
        }

        public Builder rideHeight(double rideHeight) {
            this.rideHeight = rideHeight;
            return this;
        }

        public Builder rake(double rake) {
            this.rake = rake;
            return this;
        }

        public Builder loadedRadius(double loadedRadius) {
            this.loadedRadius = loadedRadius;
            return this;
        }

        public Builder track(double track) {
            this.track = track;
            return this;
        }

        public Builder toe(double toe) {
            this.toe = toe;
            return this;
        }

        public Builder caster(double caster) {
            this.caster = caster;
            return this;
        }

        public Builder casterGain(double casterGain) {
            this.casterGain = casterGain;
            return this;
        }

        public Builder pitchCenter(double pitchCenter) {
            this.pitchCenter = pitchCenter;
            return this;
        }

        public Builder camber(double camber) {
            this.camber = camber;
            return this;
        }

        public Builder camberGain(double camberGain) {
            this.camberGain = camberGain;
            return this;
        }

        public Builder rollCenter(double rollCenter) {
            this.rollCenter = rollCenter;
            return this;
        }

        public Builder scrub(double scrub) {
            this.scrub = scrub;
            return this;
        }

        public Builder kpi(double kpi) {
            this.kpi = kpi;
            return this;
        }

        public Builder rideRatio(double rideRatio) {
            this.rideRatio = rideRatio;
            return this;
        }

        public Builder arbRatio(double arbRatio) {
            this.arbRatio = arbRatio;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a length that must be positive is not
         */
        public Target build() {
            if (!(track > 0)) {
                throw new IllegalArgumentException("Track must be positive: " + track);
            }
            if (!(loadedRadius > 0)) {
                throw new IllegalArgumentException("Loaded radius must be positive: " + loadedRadius);
            }
            if (frontWeightDistribution < 0 || frontWeightDistribution > 1) {
                throw new IllegalArgumentException(
                "Front weight distribution must lie in [0, 1]: " + frontWeightDistribution);
            }
            var center = cg != null ? cg : new Point3d(axle.longitudinalOffset(wheelbase, frontWeightDistribution), 0,
                                                       cgHeight);
            return new Target(linkage, axle, wheelbase, frontWeightDistribution, sprungMass, center, rideHeight, rake,
                              loadedRadius, track, toe, caster, casterGain, pitchCenter, camber, camberGain,
                              rollCenter, scrub, kpi, rideRatio, arbRatio);
        }
    }
}
