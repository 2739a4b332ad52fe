package com.sommerph.farewellbackend.service.proof;

import com.sommerph.farewellbackend.util.HashUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Recipient commitment as stored by the Farewell contract: {@code keccak256(lower(trim(address)))},
 * hex encoded with a {@code 0x} prefix (66 characters).
 */
@Service
public class RecipientCommitmentService {

    public String commit(String address) {
        return HashUtils.keccak256Hex(normalize(address));
    }

    public static String normalize(String address) {
        return address.strip().toLowerCase(Locale.ROOT);
    }

}
