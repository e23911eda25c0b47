package org.eao.jsa.testutil;

import java.util.LinkedHashMap;
import java.util.Map;
import org.eao.jsa.domain.header.FileHeader;
import org.eao.jsa.domain.naming.FileIds;

/** Header maps of typical JSA products, mutable so tests can add or drop keywords. */
public final class HeaderFixtures {
  /** Raw SCUBA-2 observation reduced by the nightly recipe. */
  public static final String SCUBA2_OBSID = "scuba2_00034_20140322T061052";
  /** Raw file of {@link #SCUBA2_OBSID}. */
  public static final String SCUBA2_RAW_FILE = "s8a20140322_00034_0001";
  /** Raw HARP observation. */
  public static final String ACSIS_OBSID = "acsis_00051_20130403T101318";
  /** Raw file of {@link #ACSIS_OBSID}. */
  public static final String ACSIS_RAW_FILE = "a20130403_00051_01_0001";
  public static final String NIGHT_ID = "jcmts20140322_850";
  public static final String RUN_ID = "jac-000000042";

  private HeaderFixtures() {}

  /** Nightly SCUBA-2 co-add with one member. */
  public static Map<String, Object> scuba2Night(String product) {
    Map<String, Object> h = new LinkedHashMap<>();
    h.put("BITPIX", -32);
    h.put("INSTREAM", "JCMT");
    h.put("TELESCOP", "JCMT");
    h.put("ASN_TYPE", "night");
    h.put("ASN_ID", NIGHT_ID);
    h.put("PRODUCT", product);
    h.put("RECIPE", "REDUCE_SCAN");
    h.put("DPRCINST", "jac-42");
    h.put("DPDATE", "2014-03-23T10:00:00");
    h.put("INSTRUME", "SCUBA-2");
    h.put("FILTER", "850");
    h.put("BANDWID", 85.0);
    h.put("OBS_TYPE", "science");
    h.put("SAM_MODE", "scan");
    h.put("PROJECT", "M13AU01");
    h.put("OBJECT", "omc1  ");
    h.put("OBSRA", 83.82);
    h.put("OBSDEC", -5.39);
    h.put("OBSRABL", 83.90);
    h.put("OBSDECBL", -5.45);
    h.put("OBSRABR", 83.74);
    h.put("OBSDECBR", -5.45);
    h.put("OBSRATR", 83.74);
    h.put("OBSDECTR", -5.33);
    h.put("OBSRATL", 83.90);
    h.put("OBSDECTL", -5.33);
    h.put("DATE-OBS", "2014-03-22T06:10:52");
    h.put("DATE-END", "2014-03-22T06:40:52");
    h.put("TAU225ST", 0.08);
    h.put("HUMSTART", 104.0);
    h.put("ELSTART", 62.5);
    h.put("MBRCNT", 1);
    h.put("MBR1", "caom:JCMT/" + SCUBA2_OBSID);
    h.put("PRVCNT", 1);
    h.put("PRV1", SCUBA2_RAW_FILE + ".sdf");
    return h;
  }

  /** Single-observation HARP product. */
  public static Map<String, Object> acsisExposure(String product) {
    Map<String, Object> h = new LinkedHashMap<>();
    h.put("BITPIX", -32);
    h.put("INSTREAM", "JCMT");
    h.put("TELESCOP", "JCMT");
    h.put("ASN_TYPE", "obs");
    h.put("OBSID", ACSIS_OBSID);
    h.put("PRODUCT", product);
    h.put("RECIPE", "REDUCE_SCIENCE_NARROWLINE");
    h.put("DPRCINST", "0x1F");
    h.put("DPDATE", "2013-04-04T02:00:00");
    h.put("INSTRUME", "HARP");
    h.put("BACKEND", "ACSIS");
    h.put("OBS_TYPE", "science");
    h.put("SAM_MODE", "raster");
    h.put("SB_MODE", "SSB");
    h.put("OBS_SB", "USB");
    h.put("RESTFRQ", 345.796e9);
    h.put("BWMODE", "250MHzx8192");
    h.put("SUBSYSNR", 1);
    h.put("IFFREQ", 5.0);
    h.put("IFCHANSP", 30517.578125);
    h.put("FRQSIGLO", 345.60);
    h.put("FRQSIGHI", 345.85);
    h.put("MOLECULE", "CO");
    h.put("TRANSITI", "3 - 2");
    h.put("OBJECT", "W3");
    h.put("OBSRA", 36.4);
    h.put("OBSDEC", 61.87);
    h.put("OBSRABL", 36.45);
    h.put("OBSDECBL", 61.85);
    h.put("OBSRABR", 36.35);
    h.put("OBSDECBR", 61.85);
    h.put("OBSRATR", 36.35);
    h.put("OBSDECTR", 61.89);
    h.put("OBSRATL", 36.45);
    h.put("OBSDECTL", 61.89);
    h.put("DATE-OBS", "2013-04-03T10:13:18");
    h.put("DATE-END", "2013-04-03T10:43:18");
    h.put("MBRCNT", 1);
    h.put("MBR1", "caom:JCMT/" + ACSIS_OBSID);
    h.put("PRVCNT", 1);
    h.put("PRV1", ACSIS_RAW_FILE + ".sdf");
    return h;
  }

  public static FileHeader header(String fileName, Map<String, Object> primary) {
    return header(fileName, primary, null, null);
  }

  public static FileHeader header(
      String fileName, Map<String, Object> primary, Map<String, Object> firstExtension, Double mocArea) {
    return new FileHeader(FileIds.fileIdOf(fileName), fileName, primary, firstExtension, mocArea);
  }
}
