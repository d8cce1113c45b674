package com.svsbrowser.springboot.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Curated mission, target and science-domain names. A page tag belongs to a category when it
 * contains one of the category's names; a tag may land in several categories.
 */
public final class TagVocabulary {

    public static final List<String> MISSIONS = List.of(
            "MAVEN", "Hubble", "Webb", "JWST", "Cassini", "Curiosity", "Perseverance",
            "Mars Reconnaissance Orbiter", "MRO", "LRO", "TESS", "Kepler", "Spitzer", "Chandra",
            "Fermi", "SDO", "SOHO", "ACE", "STEREO", "Parker Solar Probe", "New Horizons", "Juno",
            "Europa Clipper", "OSIRIS-REx", "GOES", "Landsat", "Terra", "Aqua", "NOAA", "GPM",
            "ICESat", "GRACE");

    public static final List<String> TARGETS = List.of(
            "Earth", "Moon", "Sun", "Mars", "Jupiter", "Saturn", "Venus", "Mercury", "Uranus",
            "Neptune", "Pluto", "Europa", "Titan", "Enceladus", "Io", "Ganymede", "Callisto",
            "Ceres", "Vesta", "Bennu", "Ryugu", "Comet");

    public static final List<String> DOMAINS = List.of(
            "Earth Science", "Heliophysics", "Astrophysics", "Planetary Science", "Climate",
            "Weather", "Atmosphere", "Ocean", "Land", "Ice", "Solar", "Space Weather", "Galaxies",
            "Black Holes", "Stars", "Exoplanets", "Nebulae", "Universe", "Cosmology");

    private TagVocabulary() {}

    /**
     * The tags that contain any entry of {@code vocabulary}, case-insensitively, in tag order.
     */
    public static List<String> classify(Collection<String> tags, List<String> vocabulary) {
        Set<String> matches = new LinkedHashSet<>();
        for (String tag : tags) {
            String haystack = tag.toUpperCase(Locale.ROOT);
            for (String entry : vocabulary) {
                if (haystack.contains(entry.toUpperCase(Locale.ROOT))) {
                    matches.add(tag);
                    break;
                }
            }
        }
        return new ArrayList<>(matches);
    }
}
