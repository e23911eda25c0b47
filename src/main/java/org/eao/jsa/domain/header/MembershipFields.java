package org.eao.jsa.domain.header;

import java.util.List;

/**
 * Member references of a file, in one of two header conventions.
 *
 * @param memberUris {@code MBRn} observation URIs
 * @param memberSubsystemIds {@code OBSn} subsystem observation ids
 * @since 0.1.0
 */
public record MembershipFields(List<String> memberUris, List<String> memberSubsystemIds) {
  public MembershipFields {
    memberUris = List.copyOf(memberUris);
    memberSubsystemIds = List.copyOf(memberSubsystemIds);
  }

  public int size() {
    return memberUris.size() + memberSubsystemIds.size();
  }
}
