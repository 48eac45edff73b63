package dev.founderfinder.analysis;

/**
 * A popular repository created soon after the account itself.
 *
 * @param name repository name, empty when GitHub omitted it
 * @param stars stargazer count
 * @param yearsAfterAccountCreation repository age relative to the account, one decimal
 */
public record EarlyAchievement(String name, int stars, double yearsAfterAccountCreation) {}
