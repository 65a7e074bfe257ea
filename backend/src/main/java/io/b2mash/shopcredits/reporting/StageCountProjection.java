package io.b2mash.shopcredits.reporting;

/** Open repair orders currently sitting at one stage. */
public interface StageCountProjection {

  String getStage();

  long getOpenRepairOrders();
}
