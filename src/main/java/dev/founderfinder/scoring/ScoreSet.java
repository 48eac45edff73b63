package dev.founderfinder.scoring;

/**
 * The five reported scores of a profile, each in [0, 10].
 *
 * @param technical repository quality and breadth
 * @param innovation popularity of original work plus activity
 * @param collaboration network size plus activity
 * @param age preference for the estimated age band
 * @param founderPotential weighted blend of technical, innovation and collaboration
 */
public record ScoreSet(
    double technical,
    double innovation,
    double collaboration,
    double age,
    double founderPotential) {}
